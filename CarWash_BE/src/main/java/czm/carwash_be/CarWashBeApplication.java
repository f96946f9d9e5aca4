package czm.carwash_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CarWashBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarWashBeApplication.class, args);
    }

}
