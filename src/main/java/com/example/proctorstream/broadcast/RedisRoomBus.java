package com.example.proctorstream.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Multi-instance bus over Redis pub/sub. The publishing instance delivers to its own members
 * right away and ignores the echo of its own envelope; every other instance delivers on receipt.
 */
@Component
@ConditionalOnProperty(name = "app.broadcast.bus", havingValue = "redis")
public class RedisRoomBus implements RoomBus, MessageListener {

    private static final Logger logger = LoggerFactory.getLogger(RedisRoomBus.class);

    private final RoomRegistry rooms;
    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String channel;
    private final String instanceId = UUID.randomUUID().toString();

    public RedisRoomBus(RoomRegistry rooms,
                        StringRedisTemplate redis,
                        ObjectMapper objectMapper,
                        @Value("${app.broadcast.redis-channel:proctor:rooms}") String channel) {
        this.rooms = rooms;
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.channel = channel;
    }

    @Override
    public void publish(RoomEnvelope envelope) {
        RoomEnvelope stamped = envelope.toBuilder().originInstance(instanceId).build();
        rooms.deliver(stamped);
        try {
            redis.convertAndSend(channel, objectMapper.writeValueAsString(stamped));
        } catch (JsonProcessingException e) {
            logger.error("Could not encode {} for the room bus", envelope.getEvent().getWireName(), e);
        } catch (Exception e) {
            // local members already have it; remote instances miss this one
            logger.warn("Room bus publish of {} failed: {}", envelope.getEvent().getWireName(), e.getMessage());
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            RoomEnvelope envelope = objectMapper.readValue(body, RoomEnvelope.class);
            if (instanceId.equals(envelope.getOriginInstance())) {
                return;
            }
            int reached = rooms.deliver(envelope);
            logger.debug("Relayed {} from {} to {} local connections",
                    envelope.getEvent().getWireName(), envelope.getOriginInstance(), reached);
        } catch (Exception e) {
            logger.warn("Dropping undecodable room bus message: {}", e.getMessage());
        }
    }

    public String getChannel() { return channel; }
    String getInstanceId() { return instanceId; }
}
