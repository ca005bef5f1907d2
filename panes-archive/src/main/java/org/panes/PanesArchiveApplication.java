package org.panes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PanesArchiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(PanesArchiveApplication.class, args);
    }
}
