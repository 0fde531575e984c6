package com.stratdsl.domain.value;

import com.stratdsl.domain.model.PortfolioFragment;
import java.util.Objects;

public record FragmentValue(PortfolioFragment fragment) implements DslValue {

    public FragmentValue {
        Objects.requireNonNull(fragment, "fragment");
    }

    public static FragmentValue of(PortfolioFragment fragment) {
        return new FragmentValue(fragment);
    }

    @Override
    public Kind kind() {
        return Kind.FRAGMENT;
    }

    @Override
    public String render() {
        return fragment.render();
    }
}
