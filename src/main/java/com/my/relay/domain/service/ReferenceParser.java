package com.my.relay.domain.service;

import com.my.relay.domain.exception.InvalidReferenceException;
import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.MessageRange;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 자유 형식 링크/식별자를 네트워크 접근 없이 구조화된 메시지 구간으로 바꾸고, 배치 비용을 최대 개수로 제한하기 위함.
 *
 * <p>인식하는 형태:
 * <ul>
 *     <li>내부 번호 링크: {@code https://t.me/c/123456789/10-12}, {@code prov://c/100500/10}</li>
 *     <li>공개 이름 링크: {@code https://t.me/channel_name/42}</li>
 *     <li>축약형: {@code -100123456789/100}, {@code 123456789/100-110}</li>
 * </ul>
 */
public class ReferenceParser {

    private static final String HOST = "(?:www\\.)?(?:t\\.me|telegram\\.me)/";
    private static final String SCHEME = "(?:https?|prov)://";
    private static final String RANGE_TAIL = "/(?<%s>\\d+)(?:-(?<%s>\\d+))?";

    private static final Pattern REFERENCE = Pattern.compile(
            "(?<![\\w/.])(?:"
                    + "(?:" + SCHEME + ")?(?:" + HOST + ")?c/(?<internal>-?\\d+)" + RANGE_TAIL.formatted("istart", "iend")
                    + "|(?:" + SCHEME + "(?:" + HOST + ")?|" + HOST + ")(?<name>[A-Za-z][A-Za-z0-9_]{2,31})"
                    + RANGE_TAIL.formatted("nstart", "nend")
                    + "|(?<bare>-?\\d+)" + RANGE_TAIL.formatted("bstart", "bend")
                    + ")(?![\\w/-])");

    private final int maxRangeSize;

    public ReferenceParser(int maxRangeSize) {
        if (maxRangeSize <= 0) {
            throw new IllegalArgumentException("maxRangeSize는 1 이상이어야 합니다.");
        }
        this.maxRangeSize = maxRangeSize;
    }

    public int maxRangeSize() {
        return maxRangeSize;
    }

    /**
     * 텍스트에서 첫 번째 참조를 해석한다.
     *
     * @throws InvalidReferenceException 인식 가능한 참조가 없거나 구간이 올바르지 않을 때
     */
    public MessageRange parse(String text) {
        return parseAll(text).get(0);
    }

    /**
     * 텍스트에 포함된 모든 참조를 등장 순서대로 해석한다. 결과는 비어 있지 않다.
     */
    public List<MessageRange> parseAll(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidReferenceException("참조 문자열이 비어 있습니다.");
        }
        Matcher matcher = REFERENCE.matcher(text.trim());
        List<MessageRange> ranges = new ArrayList<>();
        while (matcher.find()) {
            ranges.add(toRange(matcher));
        }
        if (ranges.isEmpty()) {
            throw new InvalidReferenceException("인식할 수 없는 참조 형식입니다: " + text.trim());
        }
        return List.copyOf(ranges);
    }

    private MessageRange toRange(Matcher matcher) {
        try {
            if (matcher.group("internal") != null) {
                return range(ConversationRef.ofShortId(Long.parseLong(matcher.group("internal"))),
                        matcher.group("istart"), matcher.group("iend"));
            }
            if (matcher.group("name") != null) {
                return range(ConversationRef.ofUsername(matcher.group("name")),
                        matcher.group("nstart"), matcher.group("nend"));
            }
            return range(ConversationRef.ofShortId(Long.parseLong(matcher.group("bare"))),
                    matcher.group("bstart"), matcher.group("bend"));
        } catch (NumberFormatException e) {
            throw new InvalidReferenceException("숫자 범위를 벗어난 참조입니다: " + matcher.group(), e);
        }
    }

    private MessageRange range(ConversationRef conversation, String start, String end) {
        long startId = Long.parseLong(start);
        long endId = end == null ? startId : Long.parseLong(end);
        if (startId <= 0) {
            throw new InvalidReferenceException("메시지 ID는 1 이상이어야 합니다: " + startId);
        }
        if (endId < startId) {
            throw new InvalidReferenceException("구간의 끝이 시작보다 앞설 수 없습니다: " + startId + "-" + endId);
        }
        if (startId > Long.MAX_VALUE - maxRangeSize) {
            throw new InvalidReferenceException("메시지 ID가 너무 큽니다: " + startId);
        }
        if (conversation.isNumeric() && conversation.numericId() == 0) {
            throw new InvalidReferenceException("대화 ID는 0일 수 없습니다.");
        }
        return MessageRange.clampedTo(conversation, startId, endId, maxRangeSize);
    }
}
