package com.zzf.bashnorm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BashNormalizerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(BashNormalizerApplication.class, args)));
    }
}
