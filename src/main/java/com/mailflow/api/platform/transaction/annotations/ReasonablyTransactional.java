package com.mailflow.api.platform.transaction.annotations;

import org.springframework.transaction.annotation.Transactional;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Meta-annotation for {@link Transactional} that also rolls back on checked exceptions. Service
 * operations in this project signal business failures (e.g. a missing plan or a non-payable
 * invoice) with checked exceptions, and none of them must leave partial writes behind.
 *
 * @see <a
 * href="https://docs.spring.io/spring-framework/reference/data-access/transaction/declarative/rolling-back.html">
 * Rolling back a declarative transaction - Spring documentation</a>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
@Transactional(rollbackFor = Exception.class)
public @interface ReasonablyTransactional {
}
