package personal.reserve.core.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Testcontainers 설정 클래스
 * 실제 MySQL 컨테이너에서 행 잠금과 커서 스트리밍을 검증
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestContainersConfiguration {

    /**
     * MySQL 컨테이너
     * @ServiceConnection으로 DataSource 자동 설정 (H2 설정을 대체)
     */
    @Bean
    @ServiceConnection
    MySQLContainer<?> mysqlContainer() {
        return new MySQLContainer<>(DockerImageName.parse("mysql:8.0.36"))
                .withDatabaseName("reserve_db")
                .withUsername("test_user")
                .withPassword("test_password")
                .withUrlParam("useCursorFetch", "true")
                .withReuse(true);
    }
}
