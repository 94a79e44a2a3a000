package mail.taxonomy.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.PropertySource;
import org.springframework.scheduling.annotation.EnableScheduling;


@EnableScheduling
@PropertySource(value = "file:./src/main/resources/secrets.properties", ignoreResourceNotFound = true)
@SpringBootApplication()
public class MailTaxonomyApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailTaxonomyApplication.class, args);
    }

}
