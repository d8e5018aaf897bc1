package com.cryptachat.servicios.entrega;

import com.cryptachat.dto.push.MessageFrame;
import com.cryptachat.entidades.Mensaje;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Notifica al receptor un mensaje que ya fue anexado al log.
 */
public class DeliveryGateway {

    private static final Logger LOGGER = Logger.getLogger(DeliveryGateway.class.getName());

    private final PushGateway pushGateway;

    public DeliveryGateway(PushGateway pushGateway) {
        this.pushGateway = Objects.requireNonNull(pushGateway, "pushGateway");
    }

    /**
     * El mensaje debe estar persistido. Los fallos se registran y no se
     * propagan: el receptor siempre puede recuperar el mensaje sondeando.
     */
    public void deliver(Mensaje stored) {
        if (stored == null || stored.getId() == null || stored.getReceptor() == null) {
            LOGGER.warning("Se intentó entregar un mensaje sin persistir; se omite");
            return;
        }
        try {
            MessageFrame frame = new MessageFrame(
                    stored.getId(),
                    stored.getEmisor(),
                    stored.getReceptor(),
                    stored.getTimeStamp(),
                    stored.getEmisorNombre(),
                    stored.getBlobReceptor());
            pushGateway.submit(stored.getReceptor(), frame);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "No se pudo notificar el mensaje " + stored.getId(), e);
        }
    }
}
