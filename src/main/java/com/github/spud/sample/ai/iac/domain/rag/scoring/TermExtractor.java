package com.github.spud.sample.ai.iac.domain.rag.scoring;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 检索词提取工具
 * <p>
 * 负责：<p> - 请求文本分词（保留下划线连接的技术词，同时拆出其组成部分）<p> - 基于显式 aws_* 与服务名映射识别资源类型<p> -
 * 从 Terraform 代码中提取 resource 声明的类型<p>
 */
public final class TermExtractor {

  static final Set<String> STOPWORDS = Set.of(
    "a", "an", "and", "are", "as", "at", "be", "by", "for", "from",
    "has", "he", "in", "is", "it", "its", "of", "on", "that", "the",
    "to", "was", "will", "with", "this", "these", "those", "have",
    "can", "could", "should", "would", "may", "might", "must",
    "create", "using", "use", "set", "get", "make", "do", "does",
    "did", "done", "your", "my", "our", "their", "his", "her"
  );

  private static final Pattern TOKEN_PATTERN = Pattern.compile("[a-zA-Z0-9]+(?:_[a-zA-Z0-9]+)*");

  private static final Pattern EXPLICIT_RESOURCE_PATTERN = Pattern.compile("aws_[a-z0-9_]+");

  private static final Pattern RESOURCE_DECLARATION_PATTERN =
    Pattern.compile("resource\\s+\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);

  // 常见服务名 -> 资源类型
  private static final Map<String, String> SERVICE_MAP = new LinkedHashMap<>();

  static {
    SERVICE_MAP.put("s3", "aws_s3_bucket");
    SERVICE_MAP.put("bucket", "aws_s3_bucket");
    SERVICE_MAP.put("ec2", "aws_instance");
    SERVICE_MAP.put("instance", "aws_instance");
    SERVICE_MAP.put("vm", "aws_instance");
    SERVICE_MAP.put("vpc", "aws_vpc");
    SERVICE_MAP.put("subnet", "aws_subnet");
    SERVICE_MAP.put("lambda", "aws_lambda_function");
    SERVICE_MAP.put("function", "aws_lambda_function");
    SERVICE_MAP.put("iam", "aws_iam_role");
    SERVICE_MAP.put("role", "aws_iam_role");
    SERVICE_MAP.put("policy", "aws_iam_policy");
    SERVICE_MAP.put("dynamodb", "aws_dynamodb_table");
    SERVICE_MAP.put("table", "aws_dynamodb_table");
    SERVICE_MAP.put("rds", "aws_db_instance");
    SERVICE_MAP.put("database", "aws_db_instance");
    SERVICE_MAP.put("security group", "aws_security_group");
    SERVICE_MAP.put("sg", "aws_security_group");
    SERVICE_MAP.put("load balancer", "aws_lb");
    SERVICE_MAP.put("alb", "aws_lb");
    SERVICE_MAP.put("elb", "aws_elb");
    SERVICE_MAP.put("route53", "aws_route53_zone");
    SERVICE_MAP.put("dns", "aws_route53_zone");
    SERVICE_MAP.put("cloudwatch", "aws_cloudwatch_log_group");
    SERVICE_MAP.put("sns", "aws_sns_topic");
    SERVICE_MAP.put("sqs", "aws_sqs_queue");
    SERVICE_MAP.put("queue", "aws_sqs_queue");
    SERVICE_MAP.put("elasticbeanstalk", "aws_elastic_beanstalk_environment");
    SERVICE_MAP.put("beanstalk", "aws_elastic_beanstalk_environment");
    SERVICE_MAP.put("ecs", "aws_ecs_cluster");
    SERVICE_MAP.put("fargate", "aws_ecs_service");
    SERVICE_MAP.put("eks", "aws_eks_cluster");
    SERVICE_MAP.put("kubernetes", "aws_eks_cluster");
  }

  private static final Map<String, Pattern> SERVICE_PATTERNS = new LinkedHashMap<>();

  static {
    SERVICE_MAP.keySet().forEach(term ->
      SERVICE_PATTERNS.put(term, Pattern.compile("\\b" + Pattern.quote(term) + "\\b")));
  }

  private TermExtractor() {
  }

  /**
   * 提取请求文本的检索词，空文本返回空结果
   */
  public static RequestTerms requestTerms(String text) {
    if (text == null || text.isBlank()) {
      return RequestTerms.empty();
    }
    return RequestTerms.of(tokens(text), detectResourceTypes(text));
  }

  /**
   * 分词：长度 > 2 且不在停用词表中，下划线词额外拆分
   */
  public static Set<String> tokens(String text) {
    Set<String> tokens = new TreeSet<>();
    Matcher matcher = TOKEN_PATTERN.matcher(text);
    while (matcher.find()) {
      String token = matcher.group().toLowerCase(Locale.ROOT);
      if (isMeaningful(token)) {
        tokens.add(token);
        addComponents(token, tokens);
      }
    }
    return tokens;
  }

  /**
   * 关键词归一化：小写、去空白，并补充下划线拆分后的组成部分
   */
  public static Set<String> expandKeywords(Collection<String> keywords) {
    Set<String> expanded = new TreeSet<>();
    for (String keyword : keywords) {
      if (keyword == null || keyword.isBlank()) {
        continue;
      }
      String normalized = keyword.trim().toLowerCase(Locale.ROOT);
      expanded.add(normalized);
      addComponents(normalized, expanded);
    }
    return expanded;
  }

  /**
   * 识别请求中提到的资源类型
   */
  public static Set<String> detectResourceTypes(String text) {
    Set<String> resources = new TreeSet<>();
    if (text == null || text.isBlank()) {
      return resources;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    Matcher matcher = EXPLICIT_RESOURCE_PATTERN.matcher(lower);
    while (matcher.find()) {
      resources.add(matcher.group());
    }
    SERVICE_PATTERNS.forEach((term, pattern) -> {
      if (pattern.matcher(lower).find()) {
        resources.add(SERVICE_MAP.get(term));
      }
    });
    return resources;
  }

  /**
   * 提取 Terraform 代码中 resource "type" 声明的类型
   */
  public static Set<String> declaredResourceTypes(String code) {
    Set<String> resources = new TreeSet<>();
    if (code == null) {
      return resources;
    }
    Matcher matcher = RESOURCE_DECLARATION_PATTERN.matcher(code);
    while (matcher.find()) {
      resources.add(matcher.group(1).trim().toLowerCase(Locale.ROOT));
    }
    return resources;
  }

  private static void addComponents(String token, Set<String> target) {
    if (token.indexOf('_') < 0) {
      return;
    }
    for (String component : token.split("_")) {
      if (isMeaningful(component)) {
        target.add(component);
      }
    }
  }

  private static boolean isMeaningful(String token) {
    return token.length() > 2 && !STOPWORDS.contains(token);
  }
}
