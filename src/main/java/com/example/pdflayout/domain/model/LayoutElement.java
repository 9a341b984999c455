package com.example.pdflayout.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One positioned visual unit on a page. The set of implementations is closed so extraction and
 * reconstruction handle every element kind explicitly.
 * Coordinates are always in the canonical top-left-origin, y-down frame.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextElement.class, name = "text"),
        @JsonSubTypes.Type(value = ImageElement.class, name = "image")
})
public sealed interface LayoutElement permits TextElement, ImageElement {

    double x();

    double y();

    double width();

    double height();
}
