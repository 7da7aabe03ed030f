package br.com.analytics.pipeline.farmer_kpi_batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FarmerKpiBatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FarmerKpiBatchApplication.class, args)));
    }

}
