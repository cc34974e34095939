package org.archivum.retention.config;

import org.archivum.retention.enums.DataType;
import org.archivum.retention.repository.RecordStore;
import org.archivum.retention.repository.RecordStoreRegistry;
import org.archivum.retention.repository.impl.TableRecordStore;
import org.archivum.retention.utils.JsonUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.core.DatabaseClient;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

@Configuration
public class RecordStoreConfig {

    @Bean
    public RecordStoreRegistry recordStoreRegistry(DatabaseClient databaseClient, JsonUtils jsonUtils) {
        List<RecordStore> stores = Arrays.stream(DataType.values())
                .map(dataType -> (RecordStore) new TableRecordStore(dataType, databaseClient, jsonUtils))
                .toList();
        return new RecordStoreRegistry(stores);
    }

    @Bean
    public Clock retentionClock() {
        return Clock.systemUTC();
    }
}
