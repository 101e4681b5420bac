package com.pwdaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PWD works red flag analyzer.
 */
@SpringBootApplication
public class PwdAuditApplication {

	public static void main(String[] args) {
		SpringApplication.run(PwdAuditApplication.class, args);
	}

}
