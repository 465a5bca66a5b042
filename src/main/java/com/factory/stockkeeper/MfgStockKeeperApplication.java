package com.factory.stockkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MfgStockKeeperApplication {

	public static void main(String[] args) {
		SpringApplication.run(MfgStockKeeperApplication.class, args);
	}

}
