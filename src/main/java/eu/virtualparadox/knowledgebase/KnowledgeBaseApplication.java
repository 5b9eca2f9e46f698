package eu.virtualparadox.knowledgebase;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgeBaseApplication {

    public static void main(final String[] args) {
        SpringApplication.run(KnowledgeBaseApplication.class, args);
    }
}
