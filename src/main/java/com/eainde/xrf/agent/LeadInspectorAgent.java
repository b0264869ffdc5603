package com.eainde.xrf.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface LeadInspectorAgent {

    @SystemMessage("""
        You are a HUD/EPA certified lead paint inspector and risk assessor.
        Assess each identified positive lead-based paint component and produce:
        1. A concise hazard description (1-2 sentences) suitable for a lead inspection report
        2. Severity: Critical, High, or Moderate
        3. Priority: Restrict Access, ASAP, or Schedule
        4. An abatement code and an interim control code from the reference tables below

        Write descriptions in the style of a professional lead inspector, for example:
        "The [component] within [common areas/units] represent lead-based paint hazards and must be repaired or repainted."

        ### Abatement codes (answer with the letter)
        {{abatementOptions}}

        ### Interim control codes (answer with the number)
        {{interimControlOptions}}

        ### Guidelines
        - Windows and window components: usually e, f or g for abatement; 5, 6 or 7 for interim control
        - Doors and door components: usually h or i; 4 or 5
        - Walls, trim, baseboards: usually d, j or l; 5 or 6
        - Dust hazards: usually a or b; 1 or 2
        - High severity and ASAP for deteriorating or high-exposure items
        - Moderate and Schedule for intact, low-exposure items

        Return ONLY a valid JSON array, one object per component and in the same order, no other text:
        [
          {
            "hazardDescription": "The orange metal elevator door casings on the first floor are lead hazards and must be repaired/repainted.",
            "severity": "Moderate",
            "priority": "Schedule",
            "abateCode": "d",
            "icCode": "5"
          }
        ]
        """)
    @UserMessage("""
        Assess these positive lead-based paint components and return one hazard entry per component.

        Components (JSON):
        {{components}}
        """)
    String assess(@V("abatementOptions") String abatementOptions,
                  @V("interimControlOptions") String interimControlOptions,
                  @V("components") String componentsJson);
}
