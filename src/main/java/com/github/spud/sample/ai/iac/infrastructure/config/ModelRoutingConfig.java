package com.github.spud.sample.ai.iac.infrastructure.config;

import com.github.spud.sample.ai.iac.application.config.GenerationProperties;
import com.github.spud.sample.ai.iac.domain.model.ChatClientCodeModel;
import com.github.spud.sample.ai.iac.domain.model.CodeModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 模型路由配置 基于 app.model.provider 选择 OpenAI 或 Ollama
 */
@Slf4j
@Configuration
public class ModelRoutingConfig {

  @Value("${app.model.provider:openai}")
  private String modelProvider;

  @Bean
  public ChatClient chatClient(
    @Qualifier("openAiChatModel") ChatModel openAiChatModel,
    @Qualifier("ollamaChatModel") ChatModel ollamaChatModel) {

    ChatModel selectedModel = selectChatModel(openAiChatModel, ollamaChatModel);
    log.info("Using {} as code generation model", modelProvider);

    return ChatClient.builder(selectedModel).build();
  }

  @Bean
  public CodeModel codeModel(ChatClient chatClient, GenerationProperties generationProperties) {
    return new ChatClientCodeModel(chatClient, generationProperties.getModelTimeout(),
      generationProperties.getMaxOutputTokens());
  }

  /**
   * 根据 provider 选择 ChatModel，未知值回退到 OpenAI
   */
  ChatModel selectChatModel(ChatModel openAiChatModel, ChatModel ollamaChatModel) {
    switch (modelProvider.toLowerCase()) {
      case "ollama":
        return ollamaChatModel;
      default:
        return openAiChatModel;
    }
  }
}
