package org.iceforge.saga.analytics.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.saga.analytics.config.SagaProperties;
import org.iceforge.saga.analytics.model.DatasetSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

@Component
public class DatasetSchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetSchemaLoader.class);

    static final List<String> REQUIRED_ROLES = List.of(
            DatasetSchema.TRANSACTION_DATE, DatasetSchema.REVENUE, DatasetSchema.LOST_REVENUE,
            DatasetSchema.CAC, DatasetSchema.CAC_PERCENT, DatasetSchema.AOV, DatasetSchema.LTV,
            DatasetSchema.ROAS, DatasetSchema.CATEGORY, DatasetSchema.REGION,
            DatasetSchema.CUSTOMER_TENURE, DatasetSchema.CUSTOMER_RECENCY,
            DatasetSchema.TOTAL_TRANSACTIONS, DatasetSchema.DAYS_SINCE_FIRST_PURCHASE,
            DatasetSchema.DISCOUNT, DatasetSchema.CUSTOMER_LIFETIME);

    private final ObjectMapper yamlMapper;
    private final SagaProperties props;

    private volatile DatasetSchema cached;

    public DatasetSchemaLoader(@Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper, SagaProperties props) {
        this.yamlMapper = Objects.requireNonNull(yamlObjectMapper);
        this.props = Objects.requireNonNull(props);
    }

    public DatasetSchema load() {
        DatasetSchema local = cached;
        if (local != null) return local;

        synchronized (this) {
            if (cached != null) return cached;
            try (InputStream in = new ClassPathResource(props.getSchemaResource()).getInputStream()) {
                DatasetSchema schema = yamlMapper.readValue(in, DatasetSchema.class);
                validate(schema);
                log.info("Loaded dataset schema '{}' with {} columns", schema.getTable(), schema.getColumns().size());
                cached = schema;
                return cached;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load dataset schema resource: " + props.getSchemaResource(), e);
            }
        }
    }

    private void validate(DatasetSchema schema) {
        if (!StringUtils.hasText(schema.getTable())) {
            throw new IllegalStateException("Dataset schema '" + props.getSchemaResource() + "' does not name a table");
        }
        for (String role : REQUIRED_ROLES) {
            if (schema.getColumns() == null || !StringUtils.hasText(schema.getColumns().get(role))) {
                throw new IllegalStateException("Dataset schema '" + props.getSchemaResource()
                        + "' does not map required column role '" + role + "'");
            }
        }
    }
}
