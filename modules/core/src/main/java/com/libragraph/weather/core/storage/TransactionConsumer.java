package com.libragraph.weather.core.storage;

@FunctionalInterface
public interface TransactionConsumer<X extends Exception> {

    void useTransaction(WriteTransaction tx) throws X;
}
