package com.example.datalake.dsdust.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.dsdust.request.SearchRequest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TermNormalizationValidatorTest {

  @Test
  void shouldTrimDropBlanksAndDuplicates() {
    SearchRequest request = SearchRequest.builder()
        .keywords(new ArrayList<>(Arrays.asList(" finance ", "", null, "Finance", "stocks")))
        .fileTypes(List.of(".CSV", "csv", "Json"))
        .build();
    ValidationContext context = new ValidationContext(request);

    new TermNormalizationValidator().validate(context);

    assertThat(context.getRequest().getKeywords()).containsExactly("finance", "stocks");
    assertThat(context.getRequest().getFileTypes()).containsExactly("csv", "json");
    assertThat(context.getRequest().getTags()).isEmpty();
    assertThat(context.getNotices()).isEmpty();
  }

  @Test
  void shouldLeaveTheCallersRequestUntouched() {
    SearchRequest request = SearchRequest.builder().keywords(List.of("  padded  ")).build();
    ValidationContext context = new ValidationContext(request);

    new TermNormalizationValidator().validate(context);

    assertThat(request.getKeywords()).containsExactly("  padded  ");
    assertThat(context.getOriginal()).isSameAs(request);
  }
}
