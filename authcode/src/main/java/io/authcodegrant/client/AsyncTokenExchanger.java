/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import io.authcodegrant.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Reactive facade over {@link TokenExchanger} for non-blocking callers. Each operation
 * runs the blocking exchange on a scheduler meant for blocking work, by default
 * {@link Schedulers#boundedElastic()}, when the returned {@link Mono} is subscribed.
 * Failures are delivered as error signals carrying the same exceptions as the blocking
 * API.
 */
public class AsyncTokenExchanger {

	private final TokenExchanger delegate;

	private final Scheduler scheduler;

	public AsyncTokenExchanger(TokenExchanger delegate) {
		this(delegate, Schedulers.boundedElastic());
	}

	public AsyncTokenExchanger(TokenExchanger delegate, Scheduler scheduler) {
		Assert.notNull(delegate, "delegate must not be null");
		Assert.notNull(scheduler, "scheduler must not be null");
		this.delegate = delegate;
		this.scheduler = scheduler;
	}

	public TokenExchanger getDelegate() {
		return delegate;
	}

	public Mono<AccessToken> exchangeCode(String code) {
		return exchangeCode(code, ExchangeOptions.none());
	}

	/**
	 * @see TokenExchanger#exchangeCode(String, ExchangeOptions)
	 */
	public Mono<AccessToken> exchangeCode(String code, ExchangeOptions options) {
		return Mono.fromCallable(() -> delegate.exchangeCode(code, options)).subscribeOn(scheduler);
	}

	public Mono<AccessToken> exchangeRefresh(AccessToken token) {
		return exchangeRefresh(token, ExchangeOptions.none());
	}

	/**
	 * @see TokenExchanger#exchangeRefresh(AccessToken, ExchangeOptions)
	 */
	public Mono<AccessToken> exchangeRefresh(AccessToken token, ExchangeOptions options) {
		return Mono.fromCallable(() -> delegate.exchangeRefresh(token, options)).subscribeOn(scheduler);
	}

	/**
	 * Emits the token after refreshing it if it was expired and refreshable.
	 * @param token the token to check
	 * @return the token
	 */
	public Mono<AccessToken> refreshIfExpired(AccessToken token) {
		return Mono.fromCallable(() -> {
			token.refreshIfExpired();
			return token;
		}).subscribeOn(scheduler);
	}

}
