package com.ogt.jobs.service;

import com.ogt.jobs.config.RabbitMQConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Avisa a los workers que hay trabajo pendiente. El mensaje es sólo una pista:
 * si se pierde, el poll programado del dispatcher encuentra el job igual.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobDispatchPublisher {

    private final RabbitTemplate rabbitTemplate;

    public void publishWakeUp(UUID jobId) {
        try {
            rabbitTemplate.convertAndSend(RabbitMQConfig.JOBS_EXCHANGE_NAME,
                    RabbitMQConfig.DISPATCH_ROUTING_KEY, jobId.toString());
            log.debug("📨 Aviso de despacho publicado para job {}", jobId);
        } catch (AmqpException e) {
            log.warn("⚠️ No se pudo publicar el aviso del job {} ({}); queda para el próximo poll",
                    jobId, e.getMessage());
        }
    }
}
