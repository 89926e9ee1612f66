package com.github.spud.sample.ai.iac.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 基于 Spring AI ChatClient 的代码生成实现，调用带超时
 */
@Slf4j
public class ChatClientCodeModel implements CodeModel {

  private final ChatClient chatClient;
  private final Duration timeout;
  private final int maxOutputTokens;

  public ChatClientCodeModel(ChatClient chatClient, Duration timeout, int maxOutputTokens) {
    this.chatClient = chatClient;
    this.timeout = timeout;
    this.maxOutputTokens = maxOutputTokens;
  }

  @Override
  public String generate(String systemPrompt, String userPrompt) {
    Prompt prompt = new Prompt(
      List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)),
      ChatOptions.builder().maxTokens(maxOutputTokens).build()
    );

    long start = System.currentTimeMillis();
    String text;
    try {
      text = Mono.fromCallable(() -> call(prompt))
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(timeout)
        .block();
    } catch (ModelFailureException e) {
      throw e;
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      if (cause instanceof TimeoutException) {
        throw new ModelFailureException("Model call timed out after " + timeout.toSeconds() + "s", cause);
      }
      throw new ModelFailureException("Model call failed: " + cause.getMessage(), cause);
    }

    log.debug("Model responded in {}ms", System.currentTimeMillis() - start);
    return ModelOutputCleaner.clean(text);
  }

  private String call(Prompt prompt) {
    ChatResponse response = chatClient.prompt(prompt).call().chatResponse();
    if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
      throw new ModelFailureException("Model returned no result");
    }
    // 空输出交给结构检查处理，进入正常的重试流程
    String text = response.getResult().getOutput().getText();
    return text != null ? text : "";
  }
}
