package com.cryptachat.restapi;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Aplicación Spring Boot que expone la API REST del chat y el canal push
 * WebSocket. Los servicios se construyen fuera de Spring y se registran como
 * singletons antes de arrancar el contexto.
 */
@SpringBootApplication
public class RestApiApplication {

    private static final Logger LOGGER = Logger.getLogger(RestApiApplication.class.getName());
    private static volatile ConfigurableApplicationContext context;

    /**
     * Inicia la aplicación en un hilo separado. El puerto se configura en
     * application.properties ({@code server.port}).
     *
     * @return latch que se libera cuando el contexto terminó de arrancar (o falló)
     */
    public static CountDownLatch startAsync(RestApiDependencies dependencies) {
        CountDownLatch started = new CountDownLatch(1);
        Thread restApiThread = new Thread(() -> {
            try {
                SpringApplication app = new SpringApplication(RestApiApplication.class);
                app.setDefaultProperties(Map.of(
                    "spring.main.banner-mode", "off",
                    "logging.level.root", "WARN",
                    "logging.level.com.cryptachat.restapi", "INFO"
                ));

                app.addInitializers(applicationContext -> {
                    var beanFactory = applicationContext.getBeanFactory();
                    beanFactory.registerSingleton("registroService", dependencies.registroService());
                    beanFactory.registerSingleton("claveService", dependencies.claveService());
                    beanFactory.registerSingleton("contactoService", dependencies.contactoService());
                    beanFactory.registerSingleton("mensajeriaService", dependencies.mensajeriaService());
                    beanFactory.registerSingleton("tokenService", dependencies.tokenService());
                    beanFactory.registerSingleton("connectionHub", dependencies.connectionHub());
                    beanFactory.registerSingleton("hubSettings", dependencies.hubSettings());
                });

                context = app.run();
                String actualPort = context.getEnvironment().getProperty("local.server.port",
                        context.getEnvironment().getProperty("server.port", "5000"));
                LOGGER.info("REST API iniciada en el puerto " + actualPort);
            } catch (Exception e) {
                LOGGER.log(Level.SEVERE, "Error al iniciar REST API", e);
            } finally {
                started.countDown();
            }
        }, "rest-api-thread");

        restApiThread.setDaemon(false);
        restApiThread.start();
        return started;
    }

    public static boolean awaitStarted(CountDownLatch started, long seconds) throws InterruptedException {
        return started.await(seconds, TimeUnit.SECONDS) && context != null;
    }

    /**
     * Detiene la aplicación Spring Boot.
     */
    public static void stop() {
        ConfigurableApplicationContext current = context;
        if (current != null) {
            SpringApplication.exit(current);
            context = null;
            LOGGER.info("REST API detenida");
        }
    }
}
