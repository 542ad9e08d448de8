package com.novoiceCluster.Realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NovoiceRealtimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(NovoiceRealtimeApplication.class, args);
    }
}
