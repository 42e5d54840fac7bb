package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.FieldExtractor;
import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.FieldSelector;
import com.studioscout.core.extract.SelectorSet;
import com.studioscout.core.model.AddressParts;

import java.util.Arrays;
import java.util.Optional;

/**
 * 주소 한 줄 "Straße 5, 10115 Berlin" 분해.
 * 쉼표로 나눈 뒤 두 번째 세그먼트를 공백 하나 단위로 나눠 [1]=우편번호, [2]=도시, 첫 세그먼트=거리.
 * 형식이 다르면(세그먼트/토큰 부족) 이 필드만 FAILED.
 */
public final class AddressExtractor implements FieldExtractor<AddressParts> {

    private final FieldSelector selector;

    public AddressExtractor(SelectorSet selectors) {
        this.selector = selectors.get(SelectorSet.ADDRESS);
    }

    @Override
    public String fieldName() { return "address"; }

    @Override
    public FieldResult<AddressParts> extract(PageTree tree) {
        Optional<String> text = tree.findFirst(selector).map(tree::text);
        if (text.isEmpty()) return FieldResult.absent();
        try {
            return FieldResult.present(split(text.get()));
        } catch (MalformedAddressException e) {
            return FieldResult.failed(e);
        }
    }

    /** 빈 세그먼트/토큰도 위치를 차지한다(-1 limit). */
    public static AddressParts split(String text) throws MalformedAddressException {
        String[] segments = text.split(",", -1);
        if (segments.length < 2) {
            throw new MalformedAddressException("expected '<street>, <postal> <city>' but got: " + text);
        }
        String[] tokens = segments[1].split(" ", -1);
        if (tokens.length < 3) {
            throw new MalformedAddressException("expected ' <postal> <city>' after comma but got: '" + segments[1] + "'");
        }
        return new AddressParts(Arrays.asList(segments), tokens[1], tokens[2], segments[0]);
    }

    /** 주소 텍스트가 고정 위치 분해에 필요한 토큰을 갖지 못함 */
    public static final class MalformedAddressException extends Exception {
        public MalformedAddressException(String message) { super(message); }
    }
}
