package com.example.deckfinds.service;

import com.example.deckfinds.model.Find;
import org.springframework.stereotype.Component;

/**
 * No viewer history available: every find counts as new.
 */
@Component
public class AlwaysNewNoveltyCheck implements NoveltyCheck {

    @Override
    public boolean isNew(Find find) {
        return true;
    }
}
