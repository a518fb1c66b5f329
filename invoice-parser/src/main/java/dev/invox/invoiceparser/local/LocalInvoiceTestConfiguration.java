package dev.invox.invoiceparser.local;

import dev.invox.files.InMemoryFileTaskRepository;
import dev.invox.usage.InMemoryModelUsageRepository;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * In-memory storage used when the service runs without Firestore.
 */
@Configuration
@Profile("local-invoice-test")
public class LocalInvoiceTestConfiguration {

    @Bean
    public InMemoryFileTaskRepository fileTaskRepository(Clock clock) {
        return new InMemoryFileTaskRepository(clock);
    }

    @Bean
    public InMemoryModelUsageRepository modelUsageRepository() {
        return new InMemoryModelUsageRepository();
    }
}
