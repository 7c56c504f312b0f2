package org.iceforge.saga.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SagaAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SagaAnalyticsApplication.class, args);
    }
}
