package io.github.cyfko.eligian.core.model;

import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.List;

/**
 * Root of the intermediate representation: one compilation unit.
 * <p>
 * Documents are immutable. Every stage that rewrites a document returns a new instance built
 * from fresh containers, so a caller never observes a partially rewritten input.
 * </p>
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>engine and layout settings ({@code engine}, {@code containerSelector}, {@code language},
 *       {@code layoutTemplate}, {@code availableLanguages})</li>
 *   <li>reusable {@link ActionDefinition}s</li>
 *   <li>one or more {@link Timeline}s</li>
 *   <li>{@link CompilationMetadata}, attached by the pipeline after transformation</li>
 * </ul>
 *
 * @param id                 unique document identifier
 * @param engine             targeted engine
 * @param containerSelector  selector of the presentation root element
 * @param language           default language code
 * @param layoutTemplate     layout template name
 * @param availableLanguages languages offered to the viewer
 * @param actions            reusable action definitions
 * @param timelines          playback tracks
 * @param metadata           compilation metadata, {@code null} until attached
 * @param location           source span of the whole program
 * @author Frank KOSSI
 * @since 0.0.1
 */
public record IrDocument(
        String id,
        EngineInfo engine,
        String containerSelector,
        String language,
        String layoutTemplate,
        List<LanguageLabel> availableLanguages,
        List<ActionDefinition> actions,
        List<Timeline> timelines,
        CompilationMetadata metadata,
        SourceLocation location) {

    public IrDocument {
        availableLanguages = CollectionUtils.immutableList(availableLanguages);
        actions = CollectionUtils.immutableList(actions);
        timelines = CollectionUtils.immutableList(timelines);
        location = location == null ? SourceLocation.unknown() : location;
    }

    public IrDocument withTimelines(List<Timeline> timelines) {
        return new IrDocument(id, engine, containerSelector, language, layoutTemplate,
                availableLanguages, actions, timelines, metadata, location);
    }

    public IrDocument withActions(List<ActionDefinition> actions) {
        return new IrDocument(id, engine, containerSelector, language, layoutTemplate,
                availableLanguages, actions, timelines, metadata, location);
    }

    public IrDocument withMetadata(CompilationMetadata metadata) {
        return new IrDocument(id, engine, containerSelector, language, layoutTemplate,
                availableLanguages, actions, timelines, metadata, location);
    }
}
