package org.mark.capability.runner;

import java.net.URI;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mark.capability.exception.RunnerUnreachableException;


class LlamaServerRunnerTest {
	
	@Test
	void testExtractChatContent() throws Exception {
		String body = "{\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"Hi\"}}]}";
		
		Assertions.assertEquals("Hi", LlamaServerRunner.extractContent(body));
	}
	
	
	@Test
	void testExtractTextCompletion() throws Exception {
		Assertions.assertEquals("Hello", LlamaServerRunner.extractContent("{\"choices\":[{\"text\":\"Hello\"}]}"));
		Assertions.assertEquals("raw", LlamaServerRunner.extractContent("{\"content\":\"raw\",\"stop\":true}"));
		Assertions.assertEquals("", LlamaServerRunner.extractContent("{\"choices\":[]}"));
	}
	
	
	@Test
	void testNonJsonBody() {
		Assertions.assertThrows(RunnerUnreachableException.class, () -> LlamaServerRunner.extractContent("<html>502</html>"));
		Assertions.assertThrows(RunnerUnreachableException.class, () -> LlamaServerRunner.extractContent(""));
	}
	
	
	@Test
	void testBaseUrlIsNormalized() {
		LlamaServerRunner runner = new LlamaServerRunner(null, URI.create("http://127.0.0.1:8080/"));
		
		Assertions.assertEquals("llama-server", runner.getName());
		Assertions.assertEquals(URI.create("http://127.0.0.1:8080"), runner.getBaseUrl());
	}
}
