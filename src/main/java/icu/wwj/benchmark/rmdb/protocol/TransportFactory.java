package icu.wwj.benchmark.rmdb.protocol;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

@FunctionalInterface
public interface TransportFactory {
    
    Future<Transport> connect(Vertx vertx);
}
