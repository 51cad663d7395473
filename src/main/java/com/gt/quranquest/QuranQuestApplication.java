package com.gt.quranquest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.ApplicationPidFileWriter;
import org.springframework.context.annotation.ComponentScan;

// The PostgreSQL data source is declared in PGBeanConfig only when that store is selected
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ComponentScan("com.gt.quranquest")
public class QuranQuestApplication {

	public static void main(String[] args) {
		SpringApplication springApplication = new SpringApplication(QuranQuestApplication.class);
		springApplication.addListeners(new ApplicationPidFileWriter());
		springApplication.run(args);
	}

}
