package com.di.retailetl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test without a Spring context; a full context would need a reachable database.
 */
@DisplayName("RetailEtlApplication Tests")
class RetailEtlApplicationTests {

	@Test
	@DisplayName("Should have a public static main method")
	void testMainMethodExists() throws NoSuchMethodException {
		Method main = RetailEtlApplication.class.getMethod("main", String[].class);
		assertTrue(Modifier.isStatic(main.getModifiers()));
		assertTrue(Modifier.isPublic(main.getModifiers()));
	}

	@Test
	@DisplayName("Should leave data source setup to the pipeline configuration")
	void testDataSourceAutoConfigurationExcluded() {
		SpringBootApplication annotation = RetailEtlApplication.class.getAnnotation(SpringBootApplication.class);
		assertNotNull(annotation);
		assertTrue(List.of(annotation.exclude()).contains(DataSourceAutoConfiguration.class));
	}
}
