package lab.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BridgeRelayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeRelayerApplication.class, args);
    }
}
