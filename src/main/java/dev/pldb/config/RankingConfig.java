package dev.pldb.config;

import dev.pldb.ranking.RankingProperties;
import dev.pldb.record.JsonRecordLoader;
import dev.pldb.record.RecordAccessor;
import dev.pldb.record.RecordStore;
import dev.pldb.signal.InboundLinkCounter;
import dev.pldb.signal.SignalExtractor;
import dev.pldb.signal.SignalWeights;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the record set and the signal extraction stages of the ranking engine.
 *
 * <p>The record set is read once from {@code pldb.ranking.records-dir}. Any bean can be replaced by
 * declaring one of the same type, e.g. a different {@link SignalWeights} table or a {@link
 * RecordAccessor} over another back end.
 *
 * @see dev.pldb.ranking.RankingService
 */
@Configuration
public class RankingConfig {

    private static final Logger log = LoggerFactory.getLogger(RankingConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public SignalWeights signalWeights() {
        return SignalWeights.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public SignalExtractor signalExtractor(SignalWeights signalWeights) {
        return new SignalExtractor(signalWeights);
    }

    @Bean
    @ConditionalOnMissingBean
    public InboundLinkCounter inboundLinkCounter() {
        return new InboundLinkCounter();
    }

    /**
     * Loads the record set from the configured directory.
     *
     * @param loader     JSON record loader
     * @param properties ranking configuration holding the records directory
     * @return a mutable in-memory store; empty if the directory does not exist
     */
    @Bean
    @ConditionalOnMissingBean(RecordAccessor.class)
    public RecordStore recordStore(JsonRecordLoader loader, RankingProperties properties) {
        Path directory = Path.of(properties.getRecordsDir());
        if (!Files.isDirectory(directory)) {
            log.warn("Records directory {} does not exist; starting with an empty record set",
                    directory.toAbsolutePath());
            return new RecordStore();
        }
        return loader.loadStore(directory);
    }
}
