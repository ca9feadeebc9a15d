package org.csu.proplogic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PropLogicApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropLogicApplication.class, args);
    }
}
