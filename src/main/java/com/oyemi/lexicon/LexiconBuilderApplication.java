package com.oyemi.lexicon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LexiconBuilderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LexiconBuilderApplication.class, args)));
    }
}
