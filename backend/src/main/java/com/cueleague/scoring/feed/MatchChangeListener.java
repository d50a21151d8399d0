package com.cueleague.scoring.feed;

@FunctionalInterface
public interface MatchChangeListener {

    void onChange(MatchChangeEvent event);
}
