package org.archivum.retention.repository;

import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.exception.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps each {@link DataType} to the store holding its live records.
 */
@Slf4j
public class RecordStoreRegistry {

    private final Map<DataType, RecordStore> stores = new EnumMap<>(DataType.class);

    public RecordStoreRegistry(Collection<? extends RecordStore> recordStores) {
        for (RecordStore store : recordStores) {
            RecordStore previous = stores.put(store.dataType(), store);
            if (previous != null) {
                throw new ConfigurationException("Duplicate record store for data type " + store.dataType());
            }
        }
        log.info("Record store registry initialized with {} data types", stores.size());
    }

    public boolean supports(DataType dataType) {
        return dataType != null && stores.containsKey(dataType);
    }

    public RecordStore resolve(DataType dataType) {
        RecordStore store = dataType != null ? stores.get(dataType) : null;
        if (store == null) {
            throw new ConfigurationException("Unsupported data type: " + dataType);
        }
        return store;
    }

    public Set<DataType> supportedDataTypes() {
        return Collections.unmodifiableSet(stores.keySet());
    }
}
