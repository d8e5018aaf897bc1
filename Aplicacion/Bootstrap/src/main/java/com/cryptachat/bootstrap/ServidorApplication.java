package com.cryptachat.bootstrap;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.sql.DataSource;

import com.cryptachat.bootstrap.config.ServerConfig;
import com.cryptachat.configdb.DBConfig;
import com.cryptachat.controladores.conexion.ConnectionHub;
import com.cryptachat.controladores.conexion.HubSettings;
import com.cryptachat.repositorios.ClavePublicaRepository;
import com.cryptachat.repositorios.MensajeRepository;
import com.cryptachat.repositorios.SolicitudChatRepository;
import com.cryptachat.repositorios.UsuarioRepository;
import com.cryptachat.repositorios.jdbc.DatabaseInitializer;
import com.cryptachat.repositorios.jdbc.JdbcClavePublicaRepository;
import com.cryptachat.repositorios.jdbc.JdbcMensajeRepository;
import com.cryptachat.repositorios.jdbc.JdbcSolicitudChatRepository;
import com.cryptachat.repositorios.jdbc.JdbcUsuarioRepository;
import com.cryptachat.restapi.RestApiApplication;
import com.cryptachat.restapi.RestApiDependencies;
import com.cryptachat.servicios.ClaveService;
import com.cryptachat.servicios.ContactoService;
import com.cryptachat.servicios.MensajeriaService;
import com.cryptachat.servicios.RegistroService;
import com.cryptachat.servicios.entrega.DeliveryGateway;
import com.cryptachat.servicios.impl.ClaveServiceImpl;
import com.cryptachat.servicios.impl.ContactoServiceImpl;
import com.cryptachat.servicios.impl.MensajeriaServiceImpl;
import com.cryptachat.servicios.impl.RegistroServiceImpl;
import com.cryptachat.servicios.metrics.ServerMetrics;
import com.cryptachat.servicios.security.HmacTokenService;
import com.cryptachat.servicios.security.PasswordHasher;
import com.cryptachat.servicios.security.Sha256PasswordHasher;
import com.cryptachat.servicios.security.TokenService;

/**
 * Inyección manual de dependencias del servidor: base de datos, servicios,
 * hub de conexiones, canal push TCP y API REST con su WebSocket.
 */
public final class ServidorApplication {

    private static final Logger LOGGER = Logger.getLogger(ServidorApplication.class.getName());

    private final ConnectionHub connectionHub;
    private final TcpPushServer tcpServer;
    private final RestApiDependencies restApiDependencies;

    public ServidorApplication() {
        ServerConfig serverConfig = ServerConfig.getInstance();
        DataSource dataSource = DBConfig.getInstance().getMySqlDataSource();
        DatabaseInitializer.ensureSchema(dataSource);

        UsuarioRepository usuarioRepository = new JdbcUsuarioRepository(dataSource);
        ClavePublicaRepository clavePublicaRepository = new JdbcClavePublicaRepository(dataSource);
        SolicitudChatRepository solicitudChatRepository = new JdbcSolicitudChatRepository(dataSource);
        MensajeRepository mensajeRepository = new JdbcMensajeRepository(dataSource);

        ServerMetrics.startMetricsServer(serverConfig.getMetricsPort());

        HubSettings hubSettings = serverConfig.getHubSettings();
        this.connectionHub = new ConnectionHub(hubSettings);

        TokenService tokenService = new HmacTokenService(serverConfig.getTokenSecret(), serverConfig.getTokenTtl());
        PasswordHasher passwordHasher = new Sha256PasswordHasher(serverConfig.getSecuritySalt());
        RegistroService registroService = new RegistroServiceImpl(usuarioRepository, passwordHasher, tokenService);
        ClaveService claveService = new ClaveServiceImpl(clavePublicaRepository);
        ContactoService contactoService = new ContactoServiceImpl(usuarioRepository, solicitudChatRepository);
        MensajeriaService mensajeriaService = new MensajeriaServiceImpl(usuarioRepository, mensajeRepository,
                new DeliveryGateway(connectionHub));

        this.tcpServer = new TcpPushServer(serverConfig.getPushTcpPort(), serverConfig.getMaxConnections(),
                tokenService, connectionHub, hubSettings);
        this.restApiDependencies = new RestApiDependencies(registroService, claveService, contactoService,
                mensajeriaService, tokenService, connectionHub, hubSettings);
    }

    public void start() throws IOException, InterruptedException {
        connectionHub.start();
        tcpServer.start();
        CountDownLatch started = RestApiApplication.startAsync(restApiDependencies);
        if (!RestApiApplication.awaitStarted(started, 60)) {
            LOGGER.severe("La API REST no arrancó; se detiene el servidor");
            shutdown();
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "Server-Shutdown-Hook"));
        LOGGER.info("Servidor CryptaChat listo");
    }

    /**
     * Cierre ordenado: primero dejan de entrar conexiones y peticiones, luego
     * el hub cierra las conexiones vivas.
     */
    public void shutdown() {
        LOGGER.info("Iniciando cierre ordenado del servidor...");
        tcpServer.shutdown();
        RestApiApplication.stop();
        connectionHub.close();
        ServerMetrics.stopMetricsServer();
        LOGGER.info("Servidor cerrado correctamente");
    }

    public static void main(String[] args) {
        Level level = ServerConfig.getInstance().getLogLevel();
        Logger.getLogger("com.cryptachat").setLevel(level);
        try {
            new ServidorApplication().start();
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Error iniciando servidor", e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Arranque interrumpido");
        }
    }
}
