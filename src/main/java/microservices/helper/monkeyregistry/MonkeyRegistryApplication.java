package microservices.helper.monkeyregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MonkeyRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MonkeyRegistryApplication.class, args);
    }

}
