package io.b2mash.orgaccess.invite;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when an invite fails validation. The {@link InviteErrorCode} is exposed both through
 * {@link #getCode()} and as the {@code code} property of the problem body.
 */
public class InviteValidationException extends ErrorResponseException {

  private final InviteErrorCode code;

  public InviteValidationException(InviteErrorCode code, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(code, detail), null);
    this.code = code;
  }

  public InviteErrorCode getCode() {
    return code;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(InviteErrorCode code, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid invite");
    problem.setDetail(detail);
    problem.setProperty("code", code.code());
    return problem;
  }
}
