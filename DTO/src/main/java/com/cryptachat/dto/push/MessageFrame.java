package com.cryptachat.dto.push;

import java.time.LocalDateTime;

import com.cryptachat.dto.MessageDto;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName(MessageFrame.TYPE)
public class MessageFrame extends MessageDto implements PushFrame {

    public static final String TYPE = "message";

    public MessageFrame() {
    }

    public MessageFrame(Long id, Long senderId, Long recipientId, LocalDateTime timestamp,
                        String senderUsername, String encryptedBlob) {
        super(id, senderId, recipientId, timestamp, senderUsername, encryptedBlob);
    }
}
