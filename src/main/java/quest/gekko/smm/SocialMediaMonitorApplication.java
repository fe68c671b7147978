package quest.gekko.smm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SocialMediaMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialMediaMonitorApplication.class, args);
    }

}
