package com.hhplus.furniture.config;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.testcontainers.containers.MySQLContainer;

/**
 * 영속성 테스트가 공유하는 MySQL 컨테이너 설정
 */
public final class MySQLTestContainer {

    public static final String MYSQL_IMAGE = "mysql:8.0.35";

    private MySQLTestContainer() {
    }

    public static MySQLContainer<?> create() {
        return new MySQLContainer<>(MYSQL_IMAGE)
                .withDatabaseName("furniture_test")
                .withUsername("root")
                .withPassword("root")
                .withCommand(
                        "--character-set-server=utf8mb4",
                        "--collation-server=utf8mb4_unicode_ci",
                        "--default-storage-engine=InnoDB"
                );
    }

    public static void register(DynamicPropertyRegistry registry, MySQLContainer<?> container) {
        registry.add("spring.datasource.url", container::getJdbcUrl);
        registry.add("spring.datasource.username", container::getUsername);
        registry.add("spring.datasource.password", container::getPassword);
        registry.add("spring.datasource.driver-class-name", container::getDriverClassName);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }
}
