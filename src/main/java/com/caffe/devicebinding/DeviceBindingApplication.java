package com.caffe.devicebinding;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.caffe.devicebinding")
@EnableJpaRepositories(basePackages = "com.caffe.devicebinding.infrastructure.jpa")
@EntityScan(basePackages = "com.caffe.devicebinding.infrastructure.jpa")
public class DeviceBindingApplication {
	public static void main(String[] args) {
		SpringApplication.run(DeviceBindingApplication.class, args);
	}
}
