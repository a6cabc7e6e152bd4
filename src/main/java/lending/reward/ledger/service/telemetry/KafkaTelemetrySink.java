package lending.reward.ledger.service.telemetry;

import lending.reward.ledger.event.LedgerTelemetryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes telemetry events to Kafka
 * Partition key = user ID, so the read model sees each user's changes in order
 */
@Slf4j
@Service
public class KafkaTelemetrySink implements TelemetrySink {

    @Autowired
    private KafkaTemplate<String, LedgerTelemetryEvent> telemetryKafkaTemplate;

    @Value("${ledger.telemetry.topic:ledger.telemetry}")
    private String telemetryTopic;

    @Override
    public CompletableFuture<SendResult<String, LedgerTelemetryEvent>> push(LedgerTelemetryEvent event) {
        log.debug("Publishing telemetry: type={}, userId={}, messageId={}",
                event.getType(), event.getUserId(), event.getMessageId());

        CompletableFuture<SendResult<String, LedgerTelemetryEvent>> future =
                telemetryKafkaTemplate.send(telemetryTopic, event.partitionKey(), event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.debug("Telemetry published: messageId={}, partition={}, offset={}",
                        event.getMessageId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });

        return future;
    }
}
