package org.dxworks.pageframe.recognizer;

import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.ElementContext;
import org.dxworks.pageframe.model.ExtractedStyles;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One predicate of a {@link RecognitionPattern}. The set of variants is closed.
 */
public sealed interface PatternCondition {

    boolean test(AnalyzedElement element);

    String describe();

    static PatternCondition tag(String... tags) {
        return new Tag(List.of(tags));
    }

    static PatternCondition classes(String... keywords) {
        return new ClassKeyword(List.of(keywords));
    }

    static PatternCondition style(String description, Predicate<ExtractedStyles> predicate) {
        return new Style(description, predicate);
    }

    static PatternCondition content(String regex) {
        return new Content(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    static PatternCondition shape(String description, Predicate<AnalyzedElement> predicate) {
        return new ChildShape(description, predicate);
    }

    static PatternCondition role(String... roles) {
        return new AriaRole(List.of(roles));
    }

    static PatternCondition context(String description, Predicate<ElementContext> predicate) {
        return new Context(description, predicate);
    }

    static PatternCondition attr(String name, String regex) {
        return new Attribute(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    final class Tag implements PatternCondition {
        private final List<String> tags;

        Tag(List<String> tags) {
            this.tags = tags;
        }

        @Override
        public boolean test(AnalyzedElement element) {
            return tags.contains(element.tagName);
        }

        @Override
        public String describe() {
            return "tag" + tags;
        }
    }

    /**
     * Case-insensitive substring match against any class name.
     */
    final class ClassKeyword implements PatternCondition {
        private final List<String> keywords;

        ClassKeyword(List<String> keywords) {
            this.keywords = keywords;
        }

        @Override
        public boolean test(AnalyzedElement element) {
            return element.hasClassKeyword(keywords);
        }

        @Override
        public String describe() {
            return "class" + keywords;
        }
    }

    final class Style implements PatternCondition {
        private final String description;
        private final Predicate<ExtractedStyles> predicate;

        Style(String description, Predicate<ExtractedStyles> predicate) {
            this.description = description;
            this.predicate = predicate;
        }

        @Override
        public boolean test(AnalyzedElement element) {
            return predicate.test(element.styles);
        }

        @Override
        public String describe() {
            return "style(" + description + ")";
        }
    }

    final class Content implements PatternCondition {
        private final Pattern pattern;

        Content(Pattern pattern) {
            this.pattern = pattern;
        }

        @Override
        public boolean test(AnalyzedElement element) {
            return pattern.matcher(element.textContent).find();
        }

        @Override
        public String describe() {
            return "content(/" + pattern.pattern() + "/)";
        }
    }

    /**
     * Structural predicate over the element and its descendants.
     */
    final class ChildShape implements PatternCondition {
        private final String description;
        private final Predicate<AnalyzedElement> predicate;

        ChildShape(String description, Predicate<AnalyzedElement> predicate) {
            this.description = description;
            this.predicate = predicate;
        }

        @Override
        public boolean test(AnalyzedElement element) {
            return predicate.test(element);
        }

        @Override
        public String describe() {
            return "shape(" + description + ")";
        }
    }

    final class AriaRole implements PatternCondition {
        private final List<String> roles;

        AriaRole(List<String> roles) {
            this.roles = roles;
        }

        @Override
        public boolean test(AnalyzedElement element) {
            String role = element.attr("role");
            return role != null && roles.contains(role.trim().toLowerCase(Locale.ROOT));
        }

        @Override
        public String describe() {
            return "role" + roles;
        }
    }

    final class Context implements PatternCondition {
        private final String description;
        private final Predicate<ElementContext> predicate;

        Context(String description, Predicate<ElementContext> predicate) {
            this.description = description;
            this.predicate = predicate;
        }

        @Override
        public boolean test(AnalyzedElement element) {
            return predicate.test(element.context);
        }

        @Override
        public String describe() {
            return "context(" + description + ")";
        }
    }

    final class Attribute implements PatternCondition {
        private final String name;
        private final Pattern pattern;

        Attribute(String name, Pattern pattern) {
            this.name = name;
            this.pattern = pattern;
        }

        @Override
        public boolean test(AnalyzedElement element) {
            String value = element.attr(name);
            return value != null && pattern.matcher(value).find();
        }

        @Override
        public String describe() {
            return "attr(" + name + "~/" + pattern.pattern() + "/)";
        }
    }
}
