package ch.so.arp.docqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocqaApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocqaApplication.class, args);
    }
}
