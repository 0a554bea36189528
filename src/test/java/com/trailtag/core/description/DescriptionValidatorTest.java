package com.trailtag.core.description;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DescriptionValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DescriptionValidator validator = new DescriptionValidator();

    private ObjectNode valid() {
        ObjectNode d = mapper.createObjectNode();
        d.put("filename", "/data/a.jpg");
        d.put("MAPLatitude", 47.0);
        d.put("MAPLongitude", 8.0);
        d.put("MAPCaptureTime", "2023_01_01_12_00_00_000");
        return d;
    }

    @Test
    void minimalDescriptionIsValid() {
        assertNull(validator.validate(valid()));
    }

    @Test
    void missingRequiredKey() {
        ObjectNode d = valid();
        d.remove("MAPCaptureTime");
        assertEquals("'MAPCaptureTime' is a required property", validator.validate(d));
    }

    @Test
    void unexpectedKey() {
        ObjectNode d = valid();
        d.put("MAPFoo", 1);
        assertTrue(validator.validate(d).contains("'MAPFoo' was unexpected"));
    }

    @Test
    void coordinatesOutOfRange() {
        ObjectNode d = valid();
        d.put("MAPLatitude", 90.5);
        assertTrue(validator.validate(d).startsWith("MAPLatitude out of range"));

        d = valid();
        d.put("MAPLongitude", -180.1);
        assertTrue(validator.validate(d).startsWith("MAPLongitude out of range"));
    }

    @Test
    void headingNeedsBothValues() {
        ObjectNode d = valid();
        d.putObject("MAPCompassHeading").put("TrueHeading", 10.0);
        assertNotNull(validator.validate(d));

        ((ObjectNode) d.get("MAPCompassHeading")).put("MagneticHeading", 10.0);
        assertNull(validator.validate(d));
    }

    @Test
    void headingOutsideFullCircle() {
        ObjectNode d = valid();
        d.putObject("MAPCompassHeading").put("TrueHeading", 360.0).put("MagneticHeading", 10.0);
        assertEquals("TrueHeading out of range [0, 360): 360.0", validator.validate(d));

        ((ObjectNode) d.get("MAPCompassHeading")).put("TrueHeading", 359.999).put("MagneticHeading", -0.5);
        assertEquals("MagneticHeading out of range [0, 360): -0.5", validator.validate(d));

        ((ObjectNode) d.get("MAPCompassHeading")).put("MagneticHeading", 0.0);
        assertNull(validator.validate(d));
    }

    @Test
    void typedOptionalFields() {
        ObjectNode d = valid();
        d.put("MAPOrientation", 1.5);
        assertEquals("MAPOrientation must be an integer", validator.validate(d));

        d = valid();
        d.put("MAPMetaTags", "duplicate");
        assertEquals("MAPMetaTags must be an object", validator.validate(d));
    }

    @Test
    void notAnObject() {
        assertNotNull(validator.validate(mapper.createArrayNode()));
        assertNotNull(validator.validate(null));
    }
}
