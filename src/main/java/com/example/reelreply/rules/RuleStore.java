package com.example.reelreply.rules;

import com.example.reelreply.domain.Rule;

import java.util.Map;

/**
 * Source of reply rules, keyed by the reel id each rule targets.
 * Read fresh on every call; no caching.
 */
public interface RuleStore {

    Map<String, Rule> loadRules();
}
