package org.iceforge.saga.analytics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.iceforge.saga.analytics.config.SagaProperties;
import org.iceforge.saga.analytics.service.DatasetSchemaLoader;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * In-memory H2 warehouse seeded with the transactions fixture.
 */
public final class TestWarehouse {
    private TestWarehouse() {}

    public static String jdbcUrl(String name) {
        return "jdbc:h2:mem:" + name + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
    }

    public static JdbcTemplate seeded(String name) {
        DataSource ds = new DriverManagerDataSource(jdbcUrl(name), "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("warehouse-fixture.sql")).execute(ds);
        return new JdbcTemplate(ds);
    }

    public static DatasetSchemaLoader schemaLoader() {
        return new DatasetSchemaLoader(new ObjectMapper(new YAMLFactory()), new SagaProperties());
    }
}
