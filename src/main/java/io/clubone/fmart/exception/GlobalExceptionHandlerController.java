package io.clubone.fmart.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandlerController {

	private static final String EXCEPTION_NAME = "inside handleOnFmartExceptions method, exception name is :";

	private static final String MESSAGE_TYPE = "messageType";

	@ExceptionHandler(value = FmartException.class)
	public ProblemDetail handleOnFmartExceptions(FmartException exception) {
		ProblemDetail problemDetail;
		if (exception instanceof UnauthorizedRequestException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, exception.getMessage());
			problemDetail.setProperty(MESSAGE_TYPE, ExceptionType.UNAUTHORIZED.getType());
			log.warn(EXCEPTION_NAME + "UnauthorizedRequestException and statusCode is {}", 401);
		} else if (exception instanceof InvalidParamsException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
			problemDetail.setProperty(MESSAGE_TYPE, ExceptionType.VALIDATION.getType());
			problemDetail.setProperty("errors", ((InvalidParamsException) exception).getErrors().asMap());
			log.error(EXCEPTION_NAME + "InvalidParamsException and statusCode is {}", 400);
		} else if (exception instanceof InvalidRequestException || exception instanceof EncodingException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
			problemDetail.setProperty(MESSAGE_TYPE, ExceptionType.VALIDATION.getType());
			log.error(EXCEPTION_NAME + "{} and statusCode is {}", exception.getClass().getSimpleName(), 400);
		} else {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, exception.getMessage());
			problemDetail.setProperty(MESSAGE_TYPE, ExceptionType.ERROR.getType());
			log.error(EXCEPTION_NAME + "{} and statusCode is {}", exception.getClass().getSimpleName(), 502);
		}
		return problemDetail;
	}
}
