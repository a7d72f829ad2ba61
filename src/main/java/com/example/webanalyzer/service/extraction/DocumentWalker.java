package com.example.webanalyzer.service.extraction;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Обход дерева документа в глубину.
 *
 * Обход только читает дочерние узлы и атрибуты и не использует селекторы jsoup с их
 * ленивыми кэшами, поэтому несколько проходов могут одновременно читать один документ.
 */
public final class DocumentWalker {

    private DocumentWalker() {
    }

    /**
     * Вызывает {@code action} для каждого элемента поддерева, включая корень, в порядке документа.
     */
    public static void forEachElement(Node root, Consumer<Element> action) {
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof Element) {
                action.accept((Element) node);
            }
        }, root);
    }

    /**
     * Вызывает {@code action} для каждого элемента с данным именем тега (без учёта регистра).
     */
    public static void forEachElement(Node root, String tagName, Consumer<Element> action) {
        forEachElement(root, element -> {
            if (element.normalName().equalsIgnoreCase(tagName)) {
                action.accept(element);
            }
        });
    }

    /**
     * Первый узел поддерева, удовлетворяющий условию; обход останавливается на нём.
     */
    public static Optional<Node> findFirst(Node root, Predicate<Node> predicate) {
        Node[] found = new Node[1];
        NodeTraversor.filter((node, depth) -> {
            if (predicate.test(node)) {
                found[0] = node;
                return NodeFilter.FilterResult.STOP;
            }
            return NodeFilter.FilterResult.CONTINUE;
        }, root);
        return Optional.ofNullable(found[0]);
    }

    /**
     * Первый узел заданного типа.
     */
    public static <T extends Node> Optional<T> findFirst(Node root, Class<T> type) {
        return findFirst(root, type::isInstance).map(type::cast);
    }

    /**
     * Первый элемент с данным именем тега (без учёта регистра).
     */
    public static Optional<Element> findFirstElement(Node root, String tagName) {
        return findFirst(root, node -> node instanceof Element
                && ((Element) node).normalName().equalsIgnoreCase(tagName))
                .map(Element.class::cast);
    }

    /**
     * Есть ли в поддереве элемент, удовлетворяющий условию.
     */
    public static boolean anyElement(Node root, Predicate<Element> predicate) {
        return findFirst(root, node -> node instanceof Element && predicate.test((Element) node)).isPresent();
    }

    /**
     * Текст всех текстовых узлов поддерева как есть, без нормализации пробелов.
     */
    public static String text(Node root) {
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                text.append(((TextNode) node).getWholeText());
            }
        }, root);
        return text.toString();
    }
}
