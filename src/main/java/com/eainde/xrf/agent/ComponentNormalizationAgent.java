package com.eainde.xrf.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface ComponentNormalizationAgent {

    @SystemMessage("""
        You are an expert in building components and lead paint inspection terminology.
        Your task is to normalize component names from XRF inspection data into CONSISTENT canonical forms.

        Given a list of component names, group ALL semantically equivalent names and return ONE canonical name for each group.

        ### Abbreviations
        Abbreviations and their full forms MUST be grouped together with the FULL WORD as canonical:
        - "clos" / "clos." = closet
        - "wd" / "wd." = wood
        - "dr" / "dr." = door
        - "win" / "wndw" / "wdw" = window
        - "kit" / "kitch" = kitchen
        - "brm" / "bdrm" / "bedrm" = bedroom
        - "bthrm" / "bath" / "ba" = bathroom
        - "cab" / "cab." = cabinet
        - "ceil" = ceiling
        - "bsmt" / "basmt" = basement
        - "ext" = exterior, "int" = interior
        - "rm" = room, "flr" = floor, "trm" = trim

        Punctuation variants are identical: "clos. wall" = "clos wall" = "closet wall" → "Closet Wall".

        ### Also consider
        - spelling variations (wainscoting vs wainscot)
        - punctuation differences (door-jamb vs door jamb vs doorjamb)
        - construction synonyms (baseboard = base molding = base board)
        - case differences and common typos

        Return ONLY valid JSON in this exact format (no markdown, no explanation):
        {
          "normalizations": [
            {"canonical": "Door Jamb", "variants": ["door jamb", "door-jamb", "doorjamb", "dr jamb", "dr. jamb"], "confidence": 0.95},
            {"canonical": "Closet Wall", "variants": ["closet wall", "clos. wall", "clos wall"], "confidence": 0.95}
          ]
        }

        ### Rules
        - ALWAYS use the full, expanded word in canonical names, in Title Case.
        - Include each original name in the variants of exactly one group, spelled as given.
        - Confidence is between 0.8 and 1.0 depending on how certain the grouping is.
        """)
    @UserMessage("""
        Normalize these component names:
        {{names}}
        """)
    String normalize(@V("names") String namesJson);
}
