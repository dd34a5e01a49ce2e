package tw.gc.auto.equity.research.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import tw.gc.auto.equity.research.exceptions.RegistryConflictException;
import tw.gc.auto.equity.research.exceptions.RegistryIntegrityException;
import tw.gc.auto.equity.research.exceptions.RegistryNotFoundException;

@RestControllerAdvice
@Slf4j
public class RegistryExceptionHandler {

    @ExceptionHandler(RegistryNotFoundException.class)
    public ProblemDetail handleNotFound(RegistryNotFoundException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, exception.getMessage());
        problemDetail.setProperty("code", "artifact_not_found");
        problemDetail.setProperty("family", exception.getFamily());
        return problemDetail;
    }

    @ExceptionHandler(RegistryConflictException.class)
    public ProblemDetail handleConflict(RegistryConflictException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, exception.getMessage());
        problemDetail.setProperty("code", "version_conflict");
        problemDetail.setProperty("family", exception.getFamily());
        problemDetail.setProperty("version", exception.getVersion());
        return problemDetail;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
        problemDetail.setProperty("code", "bad_request");
        return problemDetail;
    }

    @ExceptionHandler(RegistryIntegrityException.class)
    public ProblemDetail handleCorrupted(RegistryIntegrityException exception) {
        log.error("❌ Registry integrity failure: {}", exception.getMessage());
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, exception.getMessage());
        problemDetail.setProperty("code", "integrity_error");
        problemDetail.setProperty("family", exception.getFamily());
        problemDetail.setProperty("version", exception.getVersion());
        return problemDetail;
    }
}
