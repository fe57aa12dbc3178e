package com.ogt.jobs.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitMQConfig {

    // ========== JOB SERVICE EXCHANGES ==========
    public static final String JOBS_EXCHANGE_NAME = "ogt.jobs.events";
    public static final String DISPATCH_QUEUE = "jobs.dispatch.queue";
    public static final String DISPATCH_ROUTING_KEY = "jobs.dispatch";

    @Bean
    public TopicExchange jobsExchange() {
        return new TopicExchange(JOBS_EXCHANGE_NAME);
    }

    @Bean
    public Queue dispatchQueue() {
        return QueueBuilder.durable(DISPATCH_QUEUE).build();
    }

    @Bean
    public Binding dispatchBinding(Queue dispatchQueue, TopicExchange jobsExchange) {
        return BindingBuilder.bind(dispatchQueue)
                .to(jobsExchange)
                .with(DISPATCH_ROUTING_KEY);
    }

    // ========== JSON MESSAGE CONVERTER ==========
    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(jsonMessageConverter());
        return template;
    }
}
