package com.example.mailmerge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MailMergeApplication {

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(MailMergeApplication.class);
		// The runner's own hook closes the context once the current recipient is done
		application.setRegisterShutdownHook(false);
		System.exit(SpringApplication.exit(application.run(args)));
	}

}
