package com.ais.authservice;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Basic unit test for AuthServiceApplication.
 * Context and database wiring are covered by the Testcontainers suites.
 */
class AuthServiceApplicationTests {

	@Test
	void applicationClassExists() {
		AuthServiceApplication app = new AuthServiceApplication();
		assertNotNull(app, "AuthServiceApplication should be instantiable");
	}

}
