package app.scapin.memory;

import app.scapin.memory.support.PostgresIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MemoryApplicationTests extends PostgresIntegrationTest {

	@Test
	void contextLoads() {
	}

}
