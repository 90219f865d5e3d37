package io.clubone.donation.exception;

import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandlerController {

	private final static String EXCEPTION_NAME = "inside handleOnRunTimeExceptions method, exception name is :";

	@ExceptionHandler(value = DonationException.class)
	public ProblemDetail handleDonationExceptions(DonationException exception) {
		DonationErrorCode errorCode = exception.getErrorCode();
		log.error(EXCEPTION_NAME + "{} and statusCode is {}", exception.getClass().getSimpleName(),
				errorCode.getStatus().value());
		ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), exception.getMessage());
		problemDetail.setProperty("errorCode", errorCode.name());
		problemDetail.setProperty("messageID", errorCode.getCode());
		return problemDetail;
	}

	@ExceptionHandler(value = RuntimeException.class)
	public ProblemDetail handleOnRunTimeExceptions(RuntimeException exception) {
		ProblemDetail problemDetail;
		if (exception instanceof ResourceNotFoundException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, exception.getMessage());
			log.error(EXCEPTION_NAME + "ResourceNotFoundException and statusCode is {}", 404);
		} else if (exception instanceof NotValidException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
			log.error(EXCEPTION_NAME + "NotValidException and statusCode is {}", 400);
		} else {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, exception.getMessage());
			log.error(EXCEPTION_NAME + exception.getClass().getSimpleName() + " and statusCode is {}", 500,
					exception);
		}
		return problemDetail;
	}

	@ResponseStatus(HttpStatus.BAD_REQUEST)
	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidationExceptions(MethodArgumentNotValidException ex) {
		StringBuilder stringBuilder = new StringBuilder();
		ex.getBindingResult().getAllErrors().forEach(obj -> {
			stringBuilder.append(((FieldError) obj).getField() + " : " + obj.getDefaultMessage() + ",");
		});
		return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, StringUtils.chop(stringBuilder.toString()));
	}

	@ResponseStatus(HttpStatus.BAD_REQUEST)
	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
		log.error(EXCEPTION_NAME + "HttpMessageNotReadableException and statusCode is {}", 400);
		return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
	}

	@ResponseStatus(HttpStatus.BAD_REQUEST)
	@ExceptionHandler(MissingRequestHeaderException.class)
	public ProblemDetail handleMissingHeader(MissingRequestHeaderException ex) {
		return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
	}
}
