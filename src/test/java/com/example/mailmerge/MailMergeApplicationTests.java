package com.example.mailmerge;

import com.example.mailmerge.runner.MailMergeRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "mailmerge.oauth.consent-mode=console")
class MailMergeApplicationTests {

	@Autowired
	private MailMergeRunner runner;

	@Test
	void contextLoadsAndRunWithoutOptionsIsFatal() {
		assertThat(runner.getExitCode()).isEqualTo(1);
	}

}
