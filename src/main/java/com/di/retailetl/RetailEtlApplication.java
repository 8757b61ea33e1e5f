package com.di.retailetl;

import com.di.retailetl.config.RetailEtlProperties;
import com.di.retailetl.runner.EtlRunnerService;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class RetailEtlApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(RetailEtlApplication.class, args);
		RetailEtlProperties pipelineProps = ctx.getBean(RetailEtlProperties.class);
		if (!pipelineProps.isRunOnStartup()) {
			return;
		}
		boolean success = ctx.getBean(EtlRunnerService.class).runPipeline();
		int exitCode = SpringApplication.exit(ctx, () -> success ? 0 : 1);
		System.exit(exitCode);
	}
}
