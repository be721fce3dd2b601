package com.example.cruscotto;

import com.example.cruscotto.application.service.PipelineService;
import com.example.cruscotto.application.service.UrlOverrideTable;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest(properties = {
		"cruscotto.acquisition.pdf-directory=target/test-data/pdfs",
		"cruscotto.storage.output-directory=target/test-data/parquet",
		"cruscotto.pipeline.run-on-startup=false"
})
class CruscottoApplicationTests {

	@Autowired
	private PipelineService pipelineService;

	@Autowired
	private UrlOverrideTable urlOverrideTable;

	/**
	 * Ensures the application context loads and binds the override table from configuration.
	 */
	@Test
	void contextLoads() {
		assertThat(pipelineService).isNotNull();
		assertThat(urlOverrideTable.size()).isEqualTo(51);
	}

}
