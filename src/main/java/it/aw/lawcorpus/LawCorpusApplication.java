package it.aw.lawcorpus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LawCorpusApplication {

    public static void main(String[] args) {
        SpringApplication.run(LawCorpusApplication.class, args);
    }
}
