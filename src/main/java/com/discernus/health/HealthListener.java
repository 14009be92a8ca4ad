package com.discernus.health;

@FunctionalInterface
public interface HealthListener {
    void onTransition(HealthTransition transition);
}
