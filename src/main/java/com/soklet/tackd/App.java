/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.soklet.tackd;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.pyranid.Database;
import com.soklet.ShutdownTrigger;
import com.soklet.Soklet;
import com.soklet.SokletConfig;
import com.soklet.tackd.model.db.Role.RoleId;
import com.soklet.tackd.service.CleanupCoordinator;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Encapsulates the entire system in a single reusable type.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class App {
	public static void main(String[] args) throws Exception {
		String environment = System.getenv("TACKD_ENVIRONMENT");

		if (environment == null)
			throw new IllegalArgumentException("You must specify the TACKD_ENVIRONMENT environment variable");

		App app = new App(new Configuration(environment));
		app.startServer();
	}

	@NonNull
	private final Configuration configuration;
	@NonNull
	private final Injector injector;
	@NonNull
	private final Logger logger;

	public App(@NonNull Configuration configuration,
						 @Nullable Module... testingModules) {
		requireNonNull(configuration);

		// Use Guice modules for DI.
		// Also permit overrides for testing, e.g. swap in a controllable clock
		Module module = new AppModule(configuration);

		if (testingModules != null)
			module = Modules.override(module).with(testingModules);

		this.configuration = configuration;
		this.injector = Guice.createInjector(module);
		this.logger = LoggerFactory.getLogger(App.class);

		initializeDatabase();

		// Make sure the cleanup control record exists and isn't stuck from a crashed sweep
		getInjector().getInstance(CleanupCoordinator.class).adminInit();
	}

	public void startServer() throws InterruptedException {
		SokletConfig config = getInjector().getInstance(SokletConfig.class);

		// Drain anything that expired while we were down
		getInjector().getInstance(CleanupCoordinator.class).cleanupInit();

		try (Soklet soklet = Soklet.fromConfig(config)) {
			soklet.start();

			if (getConfiguration().getStopOnKeypress()) {
				getLogger().debug("Press [enter] to exit");
				soklet.awaitShutdown(ShutdownTrigger.ENTER_KEY);
			} else {
				soklet.awaitShutdown();
			}
		}
	}

	// A real deployment would keep its DDL in migration files outside of Java code
	private void initializeDatabase() {
		Database database = getInjector().getInstance(Database.class);

		// Readers never block on the background sweep's row updates
		database.execute("SET DATABASE TRANSACTION CONTROL MVCC");

		database.execute("""
				CREATE TABLE role (
					role_id VARCHAR(64) PRIMARY KEY,
					description VARCHAR(256) NOT NULL,
					can_create BOOLEAN NOT NULL,
					can_list BOOLEAN NOT NULL,
					can_delete BOOLEAN NOT NULL
				)
				""");

		database.executeBatch("INSERT INTO role (role_id, description, can_create, can_list, can_delete) VALUES (?,?,?,?,?)",
				List.of(
						List.of(RoleId.ANONYMOUS, "Anonymous", true, false, false),
						List.of(RoleId.USER, "User", true, true, true)
				));

		database.execute("""
				CREATE TABLE account (
					account_id UUID PRIMARY KEY,
					role_id VARCHAR(64) NOT NULL REFERENCES role(role_id),
					email_address VARCHAR(320) NOT NULL,
					password_hash VARCHAR(512) NOT NULL,
					created_at TIMESTAMP NOT NULL
				)
				""");

		database.execute("CREATE UNIQUE INDEX account_email_address_unique_idx ON account(email_address)");

		database.execute("""
				CREATE TABLE api_key (
					api_key VARCHAR(64) PRIMARY KEY,
					account_id UUID NOT NULL REFERENCES account,
					secret_hash VARCHAR(512) NOT NULL,
					tags VARCHAR(4096),
					created_at TIMESTAMP NOT NULL
				)
				""");

		database.execute("""
				CREATE TABLE upload (
					upload_id UUID PRIMARY KEY,
					active BOOLEAN NOT NULL,
					content_type VARCHAR(256) NOT NULL,
					byte_length BIGINT NOT NULL,
					filename VARCHAR(256),
					tags VARCHAR(4096),
					user_agent VARCHAR(1024),
					forwarded_for VARCHAR(1024),
					max_reads INTEGER NOT NULL,
					max_seconds BIGINT NOT NULL,
					expires_at TIMESTAMP NOT NULL,
					expires_parameter VARCHAR(64),
					read_count INTEGER NOT NULL,
					owner_account_id UUID REFERENCES account(account_id),
					password_hash VARCHAR(512),
					encryption_mode VARCHAR(16) NOT NULL,
					wrapped_key VARCHAR(512),
					wrapped_key_version INTEGER,
					ignore_link_key BOOLEAN NOT NULL,
					created_at TIMESTAMP NOT NULL
				)
				""");

		// The sweep scans active uploads in expiry order
		database.execute("CREATE INDEX upload_active_expires_at_idx ON upload(active, expires_at)");
		database.execute("CREATE INDEX upload_owner_account_id_idx ON upload(owner_account_id)");

		database.execute("""
				CREATE TABLE link (
					link_id UUID PRIMARY KEY,
					upload_id UUID NOT NULL REFERENCES upload,
					key_hash VARCHAR(64),
					tags VARCHAR(4096),
					read_count INTEGER NOT NULL,
					created_at TIMESTAMP NOT NULL
				)
				""");

		database.execute("""
				CREATE TABLE cleanup_lock (
					cleanup_lock_id VARCHAR(64) PRIMARY KEY,
					active BOOLEAN NOT NULL,
					modified_at TIMESTAMP NOT NULL
				)
				""");

		getLogger().debug("Initialized database schema");
	}

	@NonNull
	public Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	public Injector getInjector() {
		return this.injector;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
