package com.github.spud.sample.ai.iac.domain.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetrieverTest {

  private static KnowledgeBase single(String id, String resourceType, String keyword) {
    return KnowledgeBase.build(List.of(new SourceRecord(id, "",
      "resource \"" + resourceType + "\" \"main\" {}", id, List.of(keyword), List.of(resourceType))));
  }

  @Test
  void shouldQueryCurrentKnowledgeBase() {
    KnowledgeBaseHolder holder = new KnowledgeBaseHolder(single("sqs", "aws_sqs_queue", "queue"));
    Retriever retriever = new Retriever(holder);

    assertThat(retriever.retrieve("an sqs queue", 3, RetrievalStrategy.KEYWORD).items())
      .extracting(ScoredSnippet::id)
      .containsExactly("sqs");
  }

  @Test
  void defaultRetrieveUsesKeywordStrategy() {
    Retriever retriever = new Retriever(
      new KnowledgeBaseHolder(single("sqs", "aws_sqs_queue", "queue")));

    assertThat(retriever.retrieve("an sqs queue").items())
      .extracting(ScoredSnippet::id)
      .containsExactly("sqs");
    assertThat(retriever.retrieve("   ").isEmpty()).isTrue();
  }

  @Test
  void shouldSeeReplacedKnowledgeBase() {
    KnowledgeBaseHolder holder = new KnowledgeBaseHolder(single("sqs", "aws_sqs_queue", "queue"));
    Retriever retriever = new Retriever(holder);
    RetrievalResult before = retriever.retrieve("an sns topic", 3, RetrievalStrategy.GRAPH);

    KnowledgeBase previous = holder.replace(single("sns", "aws_sns_topic", "topic"));

    assertThat(before.isEmpty()).isTrue();
    assertThat(previous.get("sqs")).isNotNull();
    assertThat(retriever.retrieve("an sns topic", 3, RetrievalStrategy.GRAPH).items())
      .extracting(ScoredSnippet::id)
      .containsExactly("sns");
  }

  @Test
  void holderShouldRejectNullReplacement() {
    KnowledgeBaseHolder holder = new KnowledgeBaseHolder(null);

    assertThat(holder.get().isEmpty()).isTrue();
    assertThatThrownBy(() -> holder.replace(null)).isInstanceOf(IllegalArgumentException.class);
  }
}
