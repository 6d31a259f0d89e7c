package arith.todo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ArithmeticToDoApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArithmeticToDoApplication.class, args);
  }
}
