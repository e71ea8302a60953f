package com.example.layerflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LayerFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(LayerFlowApplication.class, args);
    }

}
