package com.github.spud.sample.ai.iac.domain.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 常见 AWS 资源的启发式检查，用于无法调用 Terraform CLI 的环境
 */
public final class HeuristicChecks {

  private static final Pattern AWS_INSTANCE = Pattern.compile("resource\\s+\"aws_instance\"\\s+\"([^\"]+)\"");
  private static final Pattern AWS_S3_BUCKET = Pattern.compile("resource\\s+\"aws_s3_bucket\"\\s+\"([^\"]+)\"");

  private static final Pattern AMI = Pattern.compile("(?m)^\\s*ami\\s*=\\s*(\\S.*)$");
  private static final Pattern INSTANCE_TYPE = Pattern.compile("(?m)^\\s*instance_type\\s*=\\s*(\\S.*)$");
  private static final Pattern BUCKET = Pattern.compile("(?m)^\\s*bucket\\s*=\\s*\"([^\"]*)\"");

  private static final List<String> PLACEHOLDER_AMIS = List.of("\"\"", "\"ami-...\"", "\"ami-xxxxxxxx\"");
  private static final List<String> PLACEHOLDER_BUCKET_PREFIXES = List.of("my-unique-bucket", "example-bucket");

  private HeuristicChecks() {
  }

  public static List<Diagnostic> check(String code) {
    List<Diagnostic> findings = new ArrayList<>();
    if (code == null) {
      return findings;
    }

    Matcher instance = AWS_INSTANCE.matcher(code);
    if (instance.find()) {
      String location = "aws_instance." + instance.group(1);
      Matcher ami = AMI.matcher(code);
      if (!ami.find() || PLACEHOLDER_AMIS.contains(ami.group(1).trim())) {
        findings.add(Diagnostic.error("Missing or placeholder 'ami' in aws_instance", location));
      }
      Matcher instanceType = INSTANCE_TYPE.matcher(code);
      if (!instanceType.find() || "\"\"".equals(instanceType.group(1).trim())) {
        findings.add(Diagnostic.error("Missing 'instance_type' in aws_instance", location));
      }
    }

    Matcher bucketResource = AWS_S3_BUCKET.matcher(code);
    if (bucketResource.find()) {
      Matcher bucket = BUCKET.matcher(code);
      if (bucket.find() && isPlaceholderBucket(bucket.group(1))) {
        findings.add(Diagnostic.error("Missing or placeholder 'bucket' name in aws_s3_bucket",
          "aws_s3_bucket." + bucketResource.group(1)));
      }
    }
    return findings;
  }

  private static boolean isPlaceholderBucket(String name) {
    return name.isBlank() || PLACEHOLDER_BUCKET_PREFIXES.stream().anyMatch(name::startsWith);
  }
}
