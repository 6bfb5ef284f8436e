package com.artgallery.api.config;

import com.artgallery.core.engine.TransactionEngine;
import com.artgallery.core.event.EventLog;
import com.artgallery.core.event.JsonLinesEventJournal;
import com.artgallery.core.payment.LedgerPaymentGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the registry engine. When a journal path is configured, the journal is
 * replayed into the event log at startup and every later commit is written to it
 * before it takes effect.
 */
@Configuration
public class RegistryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfiguration.class);

    @Bean
    public Clock registryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventLog eventLog() {
        return new EventLog();
    }

    @Bean
    public LedgerPaymentGateway paymentGateway(RegistryProperties properties, Clock registryClock) {
        return new LedgerPaymentGateway(properties.getEscrowAccount(), registryClock);
    }

    @Bean
    public TransactionEngine transactionEngine(RegistryProperties properties, EventLog eventLog,
                                               LedgerPaymentGateway paymentGateway, Clock registryClock) {
        if (StringUtils.hasText(properties.getJournalPath())) {
            JsonLinesEventJournal journal = new JsonLinesEventJournal(Path.of(properties.getJournalPath()));
            journal.load().forEach(eventLog::appendVerified);
            eventLog.attachJournal(journal);
            log.info("Journaling registry events to {}", journal.getPath());
        }

        if (!eventLog.isEmpty()) {
            return TransactionEngine.resume(eventLog, paymentGateway, registryClock);
        }
        return TransactionEngine.open(properties.getAdministrator(), properties.getPlatformFeeRate(),
                eventLog, paymentGateway, registryClock);
    }
}
