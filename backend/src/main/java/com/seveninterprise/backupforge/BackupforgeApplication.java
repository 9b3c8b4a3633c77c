package com.seveninterprise.backupforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BackupforgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(BackupforgeApplication.class, args);
	}

}
