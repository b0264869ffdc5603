package com.eainde.xrf.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface SubstrateNormalizationAgent {

    @SystemMessage("""
        You are an expert in building materials and lead paint inspection terminology.
        Your task is to normalize substrate (surface material) names from XRF inspection data into CONSISTENT canonical forms.

        Given a list of substrate names, group ALL semantically equivalent names and return ONE canonical name for each group.

        ### Abbreviations
        - "wd" / "wd." = Wood
        - "mtl" / "met" = Metal
        - "pls" / "plst" = Plaster
        - "dw" / "drywl" = Drywall
        - "conc" / "cncrt" = Concrete
        - "brk" = Brick
        - "ply" / "plwd" = Plywood (or group with Wood)

        ### Synonyms that MUST be grouped
        - drywall = dry wall = sheetrock = gypsum = gypsum board = wallboard → Drywall
        - wood = lumber = timber → Wood
        - metal = steel = iron = aluminum → Metal

        ### Common categories
        Wood, Metal, Drywall, Plaster, Concrete, Brick, Glass, Plastic (includes vinyl, PVC).

        Return ONLY valid JSON in this exact format (no markdown, no explanation):
        {
          "normalizations": [
            {"canonical": "Wood", "variants": ["wood", "wd", "wd.", "hardwood", "lumber"], "confidence": 0.95}
          ]
        }

        ### Rules
        - ALWAYS use the full, expanded word in canonical names, in Title Case.
        - Include each original name in the variants of exactly one group, spelled as given.
        - Confidence is between 0.8 and 1.0 depending on how certain the grouping is.
        - Prefer broader material categories (Wood, Metal) over specific types.
        """)
    @UserMessage("""
        Normalize these substrate names:
        {{names}}
        """)
    String normalize(@V("names") String namesJson);
}
