package sp.sistemaspalacios.api_homecare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiHomecareApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiHomecareApplication.class, args);
    }
}
