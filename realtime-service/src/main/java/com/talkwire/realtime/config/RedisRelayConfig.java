package com.talkwire.realtime.config;

import com.talkwire.realtime.relay.RedisBroadcastRelay;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;

@Configuration
@ConditionalOnProperty(prefix = "realtime.relay", name = "enabled", havingValue = "true")
public class RedisRelayConfig {

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            MessageListenerAdapter roomBroadcastListenerAdapter,
            RealtimeProperties properties
    ) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(roomBroadcastListenerAdapter,
                new ChannelTopic(properties.getRelay().getChannel()));
        return container;
    }

    @Bean
    public MessageListenerAdapter roomBroadcastListenerAdapter(RedisBroadcastRelay relay) {
        return new MessageListenerAdapter(relay, "onMessage");
    }
}
