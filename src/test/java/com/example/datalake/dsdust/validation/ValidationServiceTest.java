package com.example.datalake.dsdust.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.datalake.dsdust.request.SearchRequest;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationServiceTest {

  private final ValidationService service = new ValidationService(List.of(
      new ResultLimitValidator(50, 500, 30),
      new CriteriaPresentValidator(),
      new TermNormalizationValidator()));

  @Test
  void blankTermsAreRemovedBeforeThePresenceCheck() {
    SearchRequest request = SearchRequest.builder().keywords(List.of("  ", "")).build();

    assertThatThrownBy(() -> service.validate(request)).isInstanceOf(ValidationException.class);
  }

  @Test
  void validRequestComesBackNormalizedWithLimits() {
    ValidationContext context = service.validate(SearchRequest.builder().tags(List.of(" Finance ")).build());

    assertThat(context.getRequest().getTags()).containsExactly("Finance");
    assertThat(context.getRequest().getMaxResults()).isEqualTo(50);
  }

  @Test
  void rejectionsOfOneStageAreReportedTogether() {
    Validator explicitMax = new Validator() {
      @Override
      public ValidationStage stage() {
        return ValidationStage.REQUIRE;
      }

      @Override
      public void validate(ValidationContext context) {
        throw new ValidationException("maxResults must be set explicitly");
      }
    };
    ValidationService strict = new ValidationService(List.of(new CriteriaPresentValidator(), explicitMax));

    assertThatThrownBy(() -> strict.validate(new SearchRequest()))
        .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getReasons()).containsExactly(
            CriteriaPresentValidator.MESSAGE, "maxResults must be set explicitly"));
  }
}
