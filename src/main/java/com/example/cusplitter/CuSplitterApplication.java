package com.example.cusplitter;

import com.example.cusplitter.config.CuSplitterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Application entry point.
 * Only wires the application context and hands over control to Spring.
 */
@SpringBootApplication
@EnableConfigurationProperties(CuSplitterProperties.class)
public class CuSplitterApplication {

	/**
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(CuSplitterApplication.class, args);
	}

}
