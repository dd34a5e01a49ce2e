package tw.gc.auto.equity.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutomaticEquityResearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutomaticEquityResearchApplication.class, args);
    }
}
