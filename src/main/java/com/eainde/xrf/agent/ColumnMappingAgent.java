package com.eainde.xrf.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface ColumnMappingAgent {

    @SystemMessage("""
        You are an expert in XRF (X-ray Fluorescence) lead paint inspection data.
        Your task is to map spreadsheet column headers from various XRF device exports to standardized field names.

        Given a list of column headers, identify which column corresponds to each of these standard fields:

        ### Required fields
        - readingId: unique identifier for each reading (e.g. "Reading #", "Test ID", "Rdg", "Sample", "Measurement ID")
        - component: building component being tested (e.g. "Component", "Element", "Substrate Component", "Item")
        - leadContent: lead concentration in mg/cm² (e.g. "Pb", "Lead", "Result", "XRF Result", "Conc", "PbC", "Lead Content")
        - color: paint or coating color (e.g. "Color", "Colour", "Paint Color", "Coating")

        ### Optional fields
        - location: room or unit being tested (e.g. "Room", "Location", "Area", "Space")
        - unitNumber: apartment or unit number (e.g. "Unit", "Apt", "Apartment")
        - roomType: type of room (e.g. "Room Type", "Room Name")
        - roomNumber: room number within the unit (e.g. "Room #", "Rm No")
        - substrate: base material under the paint (e.g. "Substrate", "Surface", "Material")
        - side: which side of the component (e.g. "Side", "Face", "A/B")
        - condition: paint condition (e.g. "Condition", "Intact/Deficient")
        - timestamp: date or time of the reading (e.g. "Date", "Time", "DateTime")

        ### Notes
        - Devices from different manufacturers use different column names, abbreviations and truncations.
        - "Result" can hold either a concentration or a Positive/Negative verdict; use the sample data to decide.
        - A column with numeric values in mg/cm² is leadContent.
        - Room numbers like "101" or "Unit 5" are location data, never readingId.
        - Only use column names that appear in the header list, spelled exactly as given.

        Return ONLY valid JSON in this exact format (no markdown, no explanation):
        {
          "mappings": [
            {"field": "readingId", "column": "Reading #", "confidence": 0.95, "reasoning": "Standard reading ID header"},
            {"field": "leadContent", "column": "Pb (mg/cm²)", "confidence": 0.98, "reasoning": "Contains lead measurement unit"}
          ],
          "unmapped": ["Notes", "Operator"],
          "overallConfidence": 0.92
        }
        """)
    @UserMessage("""
        Map these spreadsheet column headers to XRF data fields:

        Headers: {{headers}}

        Sample data (first rows):
        {{samples}}
        """)
    String mapColumns(@V("headers") String headersJson, @V("samples") String samplesJson);
}
