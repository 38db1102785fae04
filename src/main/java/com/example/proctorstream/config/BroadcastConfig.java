package com.example.proctorstream.config;

import com.example.proctorstream.broadcast.RedisRoomBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Redis pub/sub wiring for the shared room bus. Only active with {@code app.broadcast.bus=redis}.
 */
@Configuration
@ConditionalOnProperty(name = "app.broadcast.bus", havingValue = "redis")
public class BroadcastConfig {

    @Bean
    public RedisMessageListenerContainer roomBusListenerContainer(RedisConnectionFactory connectionFactory,
                                                                  RedisRoomBus roomBus) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(roomBus, new ChannelTopic(roomBus.getChannel()));
        return container;
    }
}
