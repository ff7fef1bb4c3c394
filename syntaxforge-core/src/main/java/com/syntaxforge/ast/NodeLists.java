package com.syntaxforge.ast;

import java.util.List;

final class NodeLists {

    private NodeLists() {
    }

    static <T> List<T> copyOf(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
